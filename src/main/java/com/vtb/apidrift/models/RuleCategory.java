package com.vtb.apidrift.models;

/**
 * Аспект API, к которому относится изменение
 *
 * Сейчас заполняется только SCHEMA, остальные зарезервированы под будущие матчеры.
 */
public enum RuleCategory {
    SCHEMA("Схема"),
    ENDPOINT("Эндпоинт"),
    PARAMETER("Параметр"),
    RESPONSE("Ответ"),
    REQUEST_BODY("Тело запроса");
    
    private final String russianName;
    
    RuleCategory(String russianName) {
        this.russianName = russianName;
    }
    
    public String getRussianName() {
        return russianName;
    }
}
