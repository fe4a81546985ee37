package com.vtb.apidrift.core;

import com.vtb.apidrift.models.MatchResult;

import java.util.List;

/**
 * Контракт матчера: сравнивает один аспект двух версий API
 *
 * Сейчас реализован только SchemaMatcher. Матчеры маршрутов, параметров,
 * ответов и тел запросов должны отдавать тот же MatchResult, чтобы
 * рендерерам не требовалась отдельная логика по категориям.
 */
public interface ApiMatcher {
    
    /**
     * Сравнить версии и вернуть результаты в детерминированном порядке
     */
    List<MatchResult> match();
}
