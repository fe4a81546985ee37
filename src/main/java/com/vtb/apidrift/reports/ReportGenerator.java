package com.vtb.apidrift.reports;

import com.vtb.apidrift.models.DiffResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 *
 * CLI работает с отчетом только через этот интерфейс,
 * новый формат добавляется отдельной реализацией.
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param result результат сравнения
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(DiffResult result, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();

    /**
     * Путь отчета с расширением формата, если у имени файла его нет
     */
    default Path resolveOutputPath(Path requested) {
        Path fileName = requested.getFileName();
        if (fileName == null || fileName.toString().contains(".")) {
            return requested;
        }
        return requested.resolveSibling(fileName + "." + getFileExtension());
    }
}
