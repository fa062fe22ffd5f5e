package com.vtb.posture.reports;

import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.element.Text;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.KeywordHit;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.TrafficStats;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Генератор PDF отчетов по оценке защищенности эндпоинта.
 * Разделы: Summary, Components, Recommendations, Traffic Stats, Sensitive Data.
 */
@Slf4j
public class PdfReportGenerator implements ReportGenerator {

    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss").withZone(ZoneOffset.UTC);

    /** Шрифты с кириллицей; если ни одного нет, используется Helvetica */
    private static final List<String> FONT_CANDIDATES = List.of(
        "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
        "/usr/share/fonts/dejavu/DejaVuSans.ttf",
        "/usr/share/fonts/TTF/DejaVuSans.ttf",
        "/Library/Fonts/Arial Unicode.ttf",
        "C:/Windows/Fonts/arial.ttf"
    );

    private static final DeviceRgb HEADER_BACKGROUND = new DeviceRgb(236, 240, 241);
    private static final DeviceRgb BAR_COLOR = new DeviceRgb(102, 126, 234);
    private static final DeviceRgb ANOMALY_COLOR = new DeviceRgb(231, 76, 60);

    @Override
    public void write(ScoreReport report, OutputStream out) throws IOException {
        if (report == null || report.getResult() == null) {
            throw new IllegalArgumentException("ScoreReport не может быть null");
        }
        log.info("Генерация PDF отчета: {}", report.getEndpointId());

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            PdfDocument pdf = new PdfDocument(new PdfWriter(buffer));
            Document document = new Document(pdf);
            document.setFont(loadFont());

            addTitle(document, report);
            addSummary(document, report.getResult());
            addComponents(document, report.getResult());
            addRecommendations(document, report.getResult());
            addTrafficStats(document, report.getResult().getTrafficStats());
            addSensitiveData(document, report.getResult().getSensitiveData());

            document.close();
        } catch (Exception e) {
            throw new IOException("Ошибка генерации PDF: " + e.getMessage(), e);
        }
        out.write(buffer.toByteArray());
        log.info("PDF отчет сформирован: {} байт", buffer.size());
    }

    private PdfFont loadFont() throws IOException {
        for (String candidate : FONT_CANDIDATES) {
            if (Files.isReadable(Path.of(candidate))) {
                try {
                    return PdfFontFactory.createFont(candidate, PdfEncodings.IDENTITY_H,
                        PdfFontFactory.EmbeddingStrategy.PREFER_EMBEDDED);
                } catch (IOException e) {
                    log.debug("Шрифт {} не загружен: {}", candidate, e.getMessage());
                }
            }
        }
        return PdfFontFactory.createFont(StandardFonts.HELVETICA);
    }

    private void addTitle(Document document, ScoreReport report) {
        document.add(new Paragraph("API Security Posture Report")
            .setFontSize(24)
            .setBold()
            .setTextAlignment(TextAlignment.CENTER));

        String name = report.getEndpointName() != null ? report.getEndpointName() : report.getEndpointId();
        document.add(new Paragraph(name + " (" + report.getEndpointId() + ")")
            .setFontSize(16)
            .setTextAlignment(TextAlignment.CENTER));

        StringBuilder meta = new StringBuilder();
        if (report.getTimeRange() != null) {
            meta.append("Период: ").append(report.getTimeRange().getStart())
                .append(" - ").append(report.getTimeRange().getEnd());
        }
        if (report.getGeneratedAt() != null) {
            meta.append("   Сформирован: ").append(DATE_FORMATTER.format(report.getGeneratedAt())).append(" UTC");
        }
        document.add(new Paragraph(meta.toString())
            .setFontSize(11)
            .setTextAlignment(TextAlignment.CENTER)
            .setMarginBottom(20));
    }

    private void addSummary(Document document, CompositeScoreResult result) {
        section(document, "Summary");

        document.add(new Paragraph(String.format(Locale.ROOT, "Security Score: %.2f/100", result.getOverallScore()))
            .setFontSize(28)
            .setBold()
            .setFontColor(color(result.getLevel().getColor()))
            .setTextAlignment(TextAlignment.CENTER));
        document.add(new Paragraph(result.getLevel().getLabel())
            .setFontSize(16)
            .setTextAlignment(TextAlignment.CENTER)
            .setMarginBottom(10));

        Table table = new Table(UnitValue.createPercentArray(new float[]{1, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        table.addCell(createCell("Рекомендаций", String.valueOf(result.getRecommendations().size())));
        table.addCell(createCell("Компонентов ниже порога",
            String.valueOf(result.getComponents().stream().filter(ComponentScore::belowThreshold).count())));
        document.add(table);
    }

    private void addComponents(Document document, CompositeScoreResult result) {
        section(document, "Components");

        Table table = new Table(UnitValue.createPercentArray(new float[]{4, 2, 2, 2, 2, 2, 5}));
        table.setWidth(UnitValue.createPercentValue(100));
        for (String header : List.of("Компонент", "Оценка", "Вес", "Вклад", "Порог", "Уровень", "Факты")) {
            table.addHeaderCell(new Cell().add(new Paragraph(header).setBold()).setBackgroundColor(HEADER_BACKGROUND));
        }
        for (ComponentScore component : result.getComponents()) {
            String name = component.isDegraded() ? component.getName() + " *" : component.getName();
            table.addCell(new Cell().add(new Paragraph(name)));
            table.addCell(new Cell().add(new Paragraph(format(component.getScore()))
                .setFontColor(color(component.getLevel().getColor()))
                .setBold()));
            table.addCell(new Cell().add(new Paragraph(format(component.getWeight()))));
            table.addCell(new Cell().add(new Paragraph(format(component.getContribution()))));
            table.addCell(new Cell().add(new Paragraph(format(component.getThreshold()))));
            table.addCell(new Cell().add(new Paragraph(component.getLevel().getLabel())));
            table.addCell(new Cell().add(new Paragraph(facts(component.getFacts())).setFontSize(8)));
        }
        document.add(table);

        if (result.getComponents().stream().anyMatch(ComponentScore::isDegraded)) {
            document.add(new Paragraph("* оценка получена по неполным данным")
                .setFontSize(9)
                .setItalic());
        }
    }

    private void addRecommendations(Document document, CompositeScoreResult result) {
        section(document, "Recommendations");

        if (result.getRecommendations().isEmpty()) {
            document.add(new Paragraph("Все компоненты выше порогов, рекомендаций нет").setMarginBottom(10));
            return;
        }
        int index = 1;
        for (Recommendation rec : result.getRecommendations()) {
            document.add(new Paragraph()
                .add(new Text(index++ + ". [" + rec.getSeverity().getRussianName() + "] ")
                    .setFontColor(color(rec.getSeverity().getColor()))
                    .setBold())
                .add(new Text(rec.getTitle() + "\n").setBold())
                .add(rec.getDescription() + "\n")
                .add(new Text("Действие: ").setBold())
                .add(rec.getAction())
                .setMarginBottom(8));
        }
    }

    private void addTrafficStats(Document document, TrafficStats stats) {
        section(document, "Traffic Stats");

        if (stats == null || !stats.isTrafficAvailable()) {
            document.add(new Paragraph("Журнал трафика за период недоступен"));
            return;
        }
        Table table = new Table(UnitValue.createPercentArray(new float[]{1, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        table.addCell(createCell("Всего запросов", String.valueOf(stats.getTotalRequests())));
        table.addCell(createCell("Ошибок", stats.getErrorCount() + " (" + format(stats.getErrorRate()) + "%)"));
        table.addCell(createCell("Уникальных IP", String.valueOf(stats.getUniqueSourceIps())));
        table.addCell(createCell("Запросов в час (среднее)", format(stats.getAverageRequestsPerHour())));
        table.addCell(createCell("Запросов в час (пик)", String.valueOf(stats.getPeakRequestsPerHour())));
        table.addCell(createCell("Среднее по часам суток", format(stats.getMeanHourlyCount())));
        table.addCell(createCell("Стандартное отклонение", format(stats.getStdDevHourlyCount())));
        table.addCell(createCell("Порог аномалии", format(stats.getAnomalyThreshold())));
        table.addCell(createCell("Аномальные часы", hours(stats.getAnomalousHours())));
        table.addCell(createCell("Пиковые часы", hours(stats.getPeakHours())));
        table.addCell(createCell("Коды ответа", counts(stats.getStatusCodes())));
        table.addCell(createCell("Выборка", stats.isSampleTruncated() ? "урезана до самых новых записей" : "полная"));
        document.add(table);

        if (!stats.getTopSourceIps().isEmpty()) {
            document.add(new Paragraph("Top IP: " + counts(stats.getTopSourceIps())).setFontSize(10));
        }
        addHourlyHistogram(document, stats);
    }

    /**
     * 24 строки по часу суток, аномальные часы выделены цветом и пометкой "!"
     */
    private void addHourlyHistogram(Document document, TrafficStats stats) {
        List<Long> hourly = stats.getHourlyCounts();
        if (hourly == null || hourly.isEmpty()) {
            return;
        }
        document.add(new Paragraph("Распределение по часам").setBold().setMarginTop(10));
        long max = hourly.stream().mapToLong(Long::longValue).max().orElse(0L);

        Table table = new Table(UnitValue.createPercentArray(new float[]{2, 2, 8}));
        table.setWidth(UnitValue.createPercentValue(100));
        for (int hour = 0; hour < hourly.size(); hour++) {
            long count = hourly.get(hour);
            boolean anomalous = stats.getAnomalousHours().contains(hour);
            DeviceRgb barColor = anomalous ? ANOMALY_COLOR : BAR_COLOR;
            int width = max > 0 ? (int) (count * 40 / max) : 0;
            table.addCell(new Cell().add(new Paragraph(String.format(Locale.ROOT, "%02d:00", hour)).setFontSize(8)));
            table.addCell(new Cell().add(new Paragraph(count + (anomalous ? " !" : "")).setFontSize(8)));
            table.addCell(new Cell().add(new Paragraph("|".repeat(width)).setFontSize(8).setFontColor(barColor)));
        }
        document.add(table);
    }

    private void addSensitiveData(Document document, SensitiveDataFinding finding) {
        section(document, "Sensitive Data");

        if (finding == null || finding.isNoData()) {
            document.add(new Paragraph("Нет записей для проверки"));
            return;
        }
        document.add(new Paragraph(String.format(Locale.ROOT,
            "Проверено записей: %d, с чувствительными данными: %d (%.2f%%), словарь v%d",
            finding.getScannedEntries(), finding.getMatchingEntries(),
            finding.getMatchPercentage(), finding.getKeywordSetVersion())));
        document.add(new Paragraph("В заголовках: " + finding.getHeaderMatchingEntries()
            + ", в теле: " + finding.getBodyMatchingEntries()).setFontSize(10));

        if (finding.getHits().isEmpty()) {
            return;
        }
        Table table = new Table(UnitValue.createPercentArray(new float[]{4, 2, 2, 2, 2}));
        table.setWidth(UnitValue.createPercentValue(100));
        for (String header : List.of("Слово", "Записей", "Заголовки", "Тело", "%")) {
            table.addHeaderCell(new Cell().add(new Paragraph(header).setBold()).setBackgroundColor(HEADER_BACKGROUND));
        }
        for (KeywordHit hit : finding.getHits()) {
            table.addCell(new Cell().add(new Paragraph(hit.getKeyword())));
            table.addCell(new Cell().add(new Paragraph(String.valueOf(hit.getOccurrences()))));
            table.addCell(new Cell().add(new Paragraph(String.valueOf(hit.getInHeaders()))));
            table.addCell(new Cell().add(new Paragraph(String.valueOf(hit.getInBody()))));
            table.addCell(new Cell().add(new Paragraph(format(hit.getPercentage()))));
        }
        document.add(table);
    }

    private void section(Document document, String title) {
        document.add(new Paragraph(title)
            .setFontSize(18)
            .setBold()
            .setMarginTop(20));
    }

    private Cell createCell(String label, String value) {
        Paragraph p = new Paragraph()
            .add(new Text(label + ": ").setBold())
            .add(value);
        return new Cell().add(p).setPadding(5);
    }

    static DeviceRgb color(String hex) {
        String value = hex.startsWith("#") ? hex.substring(1) : hex;
        int rgb = Integer.parseInt(value, 16);
        return new DeviceRgb((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String hours(List<Integer> hours) {
        if (hours == null || hours.isEmpty()) {
            return "-";
        }
        return hours.stream().map(h -> String.format(Locale.ROOT, "%02d:00", h)).collect(Collectors.joining(", "));
    }

    private static String counts(Map<String, Long> counts) {
        if (counts == null || counts.isEmpty()) {
            return "-";
        }
        return counts.entrySet().stream()
            .map(e -> e.getKey() + " (" + e.getValue() + ")")
            .collect(Collectors.joining(", "));
    }

    private static String facts(Map<String, String> facts) {
        if (facts == null || facts.isEmpty()) {
            return "";
        }
        return facts.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("; "));
    }

    @Override
    public String getFileExtension() {
        return "pdf";
    }

    @Override
    public String getContentType() {
        return "application/pdf";
    }
}
