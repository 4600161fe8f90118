package com.vtb.nessus.reports;

import com.vtb.nessus.models.ReportDetails;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {

    /**
     * Отрисовать отчет в память
     *
     * @param details данные отчета
     * @throws IOException если отрисовка не удалась
     */
    byte[] render(ReportDetails details) throws IOException;

    /**
     * Сгенерировать отчет в файл
     *
     * @param details данные отчета
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    default void generate(ReportDetails details, Path outputPath) throws IOException {
        byte[] content = render(details);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(outputPath, content);
    }

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
