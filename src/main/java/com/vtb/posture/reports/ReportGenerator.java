package com.vtb.posture.reports;

import com.vtb.posture.models.ScoreReport;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Интерфейс для генераторов отчетов.
 *
 * Генераторы только отображают готовый {@link ScoreReport} и ничего не пересчитывают.
 */
public interface ReportGenerator {

    /**
     * Записать отчет в поток (поток не закрывается)
     *
     * @throws IOException если произошла ошибка записи
     */
    void write(ScoreReport report, OutputStream out) throws IOException;

    /**
     * Сгенерировать отчет в файл
     *
     * @param report результат оценки
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    default void generate(ScoreReport report, Path outputPath) throws IOException {
        try (OutputStream out = Files.newOutputStream(outputPath)) {
            write(report, out);
        }
    }

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();

    String getContentType();

    /**
     * Имя файла вида posture-{id}-{start}_{end}.{ext}
     */
    default String fileNameFor(ScoreReport report) {
        String id = report.getEndpointId() != null ? report.getEndpointId().replaceAll("[^A-Za-z0-9._-]", "_") : "endpoint";
        if (report.getTimeRange() == null) {
            return "posture-" + id + "." + getFileExtension();
        }
        return String.format("posture-%s-%s_%s.%s", id,
            report.getTimeRange().getStart(), report.getTimeRange().getEnd(), getFileExtension());
    }

    /**
     * Генератор по имени формата: json, pdf, html
     *
     * @throws IllegalArgumentException для неизвестного формата
     */
    static ReportGenerator forFormat(String format) {
        String normalized = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "json":
                return new JsonReportGenerator();
            case "pdf":
                return new PdfReportGenerator();
            case "html":
            case "htm":
                return new HtmlReportGenerator();
            default:
                throw new IllegalArgumentException("Неизвестный формат отчета: " + format);
        }
    }
}
