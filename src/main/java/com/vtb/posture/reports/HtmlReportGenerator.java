package com.vtb.posture.reports;

import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.KeywordHit;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.TrafficStats;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Генератор HTML отчета: одна самодостаточная страница без внешних ресурсов
 */
@Slf4j
public class HtmlReportGenerator implements ReportGenerator {

    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss").withZone(ZoneOffset.UTC);

    @Override
    public void write(ScoreReport report, OutputStream out) throws IOException {
        if (report == null || report.getResult() == null) {
            throw new IllegalArgumentException("ScoreReport не может быть null");
        }
        log.info("Генерация HTML отчета: {}", report.getEndpointId());
        out.write(generateHtml(report).getBytes(StandardCharsets.UTF_8));
    }

    String generateHtml(ScoreReport report) {
        CompositeScoreResult result = report.getResult();
        StringBuilder html = new StringBuilder();

        String name = report.getEndpointName() != null ? report.getEndpointName() : report.getEndpointId();
        String period = report.getTimeRange() != null
            ? report.getTimeRange().getStart() + " - " + report.getTimeRange().getEnd()
            : "-";
        String generated = report.getGeneratedAt() != null
            ? DATE_FORMATTER.format(report.getGeneratedAt()) + " UTC"
            : "-";

        html.append("""
            <!DOCTYPE html>
            <html lang="ru">
            <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
                <title>API Security Posture - %s</title>
                <style>
                    * { margin: 0; padding: 0; box-sizing: border-box; }
                    body {
                        font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, Arial, sans-serif;
                        background: #f5f7fa;
                        padding: 20px;
                        color: #2c3e50;
                    }
                    .container { max-width: 1100px; margin: 0 auto; background: white; border-radius: 12px; box-shadow: 0 2px 8px rgba(0,0,0,0.1); }
                    .header { background: linear-gradient(135deg, #667eea 0%%, #764ba2 100%%); color: white; padding: 36px; border-radius: 12px 12px 0 0; }
                    .header h1 { font-size: 28px; margin-bottom: 8px; }
                    .header p { opacity: 0.9; }
                    section { padding: 26px 36px; border-bottom: 1px solid #ecf0f1; }
                    section h2 { font-size: 22px; margin-bottom: 14px; }
                    .score { font-size: 48px; font-weight: 700; }
                    .level { display: inline-block; padding: 6px 14px; border-radius: 999px; color: white; font-weight: 600; margin-left: 12px; vertical-align: middle; }
                    table { width: 100%%; border-collapse: collapse; }
                    th, td { text-align: left; padding: 8px 10px; border-bottom: 1px solid #ecf0f1; }
                    th { background: #ecf0f1; }
                    .rec { border-left: 4px solid #bdc3c7; padding: 10px 14px; margin-bottom: 12px; background: #fafbfc; }
                    .rec h3 { font-size: 16px; margin-bottom: 4px; }
                    .severity { font-weight: 700; text-transform: uppercase; font-size: 12px; }
                    .muted { color: #7f8c8d; font-size: 13px; }
                </style>
            </head>
            <body>
            <div class="container">
                <div class="header">
                    <h1>%s</h1>
                    <p>%s &middot; Период: %s &middot; Сформирован: %s</p>
                </div>
            """.formatted(escape(name), escape(name), escape(report.getEndpointId()), period, generated));

        appendSummary(html, result);
        appendComponents(html, result);
        appendRecommendations(html, result);
        appendTrafficStats(html, result.getTrafficStats());
        appendSensitiveData(html, result.getSensitiveData());

        html.append("""
            </div>
            </body>
            </html>
            """);
        return html.toString();
    }

    private void appendSummary(StringBuilder html, CompositeScoreResult result) {
        html.append("<section id=\"summary\"><h2>Summary</h2>")
            .append("<div><span class=\"score\" style=\"color:").append(result.getLevel().getColor()).append("\">")
            .append(format(result.getOverallScore())).append("</span><span class=\"muted\"> / 100</span>")
            .append("<span class=\"level\" style=\"background:").append(result.getLevel().getColor()).append("\">")
            .append(result.getLevel().getLabel()).append("</span></div>")
            .append("<p class=\"muted\">Рекомендаций: ").append(result.getRecommendations().size()).append("</p>")
            .append("</section>\n");
    }

    private void appendComponents(StringBuilder html, CompositeScoreResult result) {
        html.append("<section id=\"components\"><h2>Components</h2><table>")
            .append("<tr><th>Компонент</th><th>Оценка</th><th>Вес</th><th>Вклад</th><th>Порог</th><th>Уровень</th><th>Факты</th></tr>");
        for (ComponentScore component : result.getComponents()) {
            html.append("<tr><td>").append(escape(component.getName()))
                .append(component.isDegraded() ? " <span class=\"muted\">(неполные данные)</span>" : "")
                .append("</td><td style=\"color:").append(component.getLevel().getColor()).append(";font-weight:700\">")
                .append(format(component.getScore()))
                .append("</td><td>").append(format(component.getWeight()))
                .append("</td><td>").append(format(component.getContribution()))
                .append("</td><td>").append(format(component.getThreshold()))
                .append("</td><td>").append(component.getLevel().getLabel())
                .append("</td><td class=\"muted\">").append(escape(facts(component.getFacts())))
                .append("</td></tr>");
        }
        html.append("</table></section>\n");
    }

    private void appendRecommendations(StringBuilder html, CompositeScoreResult result) {
        html.append("<section id=\"recommendations\"><h2>Recommendations</h2>");
        if (result.getRecommendations().isEmpty()) {
            html.append("<p>Все компоненты выше порогов, рекомендаций нет</p>");
        }
        for (Recommendation rec : result.getRecommendations()) {
            String color = rec.getSeverity().getColor();
            html.append("<div class=\"rec\" style=\"border-left-color:").append(color).append("\">")
                .append("<span class=\"severity\" style=\"color:").append(color).append("\">")
                .append(rec.getSeverity().getRussianName()).append("</span>")
                .append("<h3>").append(escape(rec.getTitle())).append("</h3>")
                .append("<p>").append(escape(rec.getDescription())).append("</p>")
                .append("<p><strong>Действие:</strong> ").append(escape(rec.getAction())).append("</p>")
                .append("</div>");
        }
        html.append("</section>\n");
    }

    private void appendTrafficStats(StringBuilder html, TrafficStats stats) {
        html.append("<section id=\"traffic\"><h2>Traffic Stats</h2>");
        if (stats == null || !stats.isTrafficAvailable()) {
            html.append("<p>Журнал трафика за период недоступен</p></section>\n");
            return;
        }
        html.append("<table>");
        row(html, "Всего запросов", String.valueOf(stats.getTotalRequests()));
        if (stats.isSampleTruncated()) {
            row(html, "Выборка", "урезана до самых новых записей");
        }
        row(html, "Ошибок", String.valueOf(stats.getErrorCount()));
        row(html, "Доля ошибок", format(stats.getErrorRate()) + "%");
        row(html, "Уникальных IP", String.valueOf(stats.getUniqueSourceIps()));
        row(html, "Запросов в час (среднее)", format(stats.getAverageRequestsPerHour()));
        row(html, "Запросов в час (пик)", String.valueOf(stats.getPeakRequestsPerHour()));
        row(html, "Среднее по часам суток", format(stats.getMeanHourlyCount()));
        row(html, "Стандартное отклонение", format(stats.getStdDevHourlyCount()));
        row(html, "Порог аномалии", format(stats.getAnomalyThreshold()));
        row(html, "Аномальные часы", hours(stats.getAnomalousHours()));
        row(html, "Пиковые часы", hours(stats.getPeakHours()));
        row(html, "Коды ответа", escape(counts(stats.getStatusCodes())));
        row(html, "Top IP", escape(counts(stats.getTopSourceIps())));
        html.append("</table>");

        List<Long> hourly = stats.getHourlyCounts();
        long max = hourly.stream().mapToLong(Long::longValue).max().orElse(0L);
        html.append("<h3 style=\"margin-top:16px\">Распределение по часам</h3><table id=\"hourly\">");
        for (int hour = 0; hour < hourly.size(); hour++) {
            long count = hourly.get(hour);
            boolean anomalous = stats.getAnomalousHours().contains(hour);
            html.append("<tr").append(anomalous ? " class=\"anomalous\"" : "").append("><td style=\"width:70px\">")
                .append(String.format(Locale.ROOT, "%02d:00", hour))
                .append("</td><td><div style=\"background:").append(anomalous ? "#e74c3c" : "#667eea")
                .append(";height:12px;width:").append(max > 0 ? count * 100 / max : 0).append("%\"></div></td><td style=\"width:80px\">")
                .append(count).append(anomalous ? " !" : "").append("</td></tr>");
        }
        html.append("</table>");
        html.append("</section>\n");
    }

    private void appendSensitiveData(StringBuilder html, SensitiveDataFinding finding) {
        html.append("<section id=\"sensitive\"><h2>Sensitive Data</h2>");
        if (finding == null || finding.isNoData()) {
            html.append("<p>Нет записей для проверки</p></section>\n");
            return;
        }
        html.append(String.format(Locale.ROOT,
            "<p>Проверено записей: %d, с чувствительными данными: %d (%.2f%%), словарь v%d</p>",
            finding.getScannedEntries(), finding.getMatchingEntries(),
            finding.getMatchPercentage(), finding.getKeywordSetVersion()));
        html.append("<p>В заголовках: ").append(finding.getHeaderMatchingEntries())
            .append(", в теле: ").append(finding.getBodyMatchingEntries()).append("</p>");
        if (!finding.getHits().isEmpty()) {
            html.append("<table><tr><th>Слово</th><th>Записей</th><th>Заголовки</th><th>Тело</th><th>%</th></tr>");
            for (KeywordHit hit : finding.getHits()) {
                html.append("<tr><td>").append(escape(hit.getKeyword()))
                    .append("</td><td>").append(hit.getOccurrences())
                    .append("</td><td>").append(hit.getInHeaders())
                    .append("</td><td>").append(hit.getInBody())
                    .append("</td><td>").append(format(hit.getPercentage()))
                    .append("</td></tr>");
            }
            html.append("</table>");
        }
        html.append("</section>\n");
    }

    private static void row(StringBuilder html, String label, String value) {
        html.append("<tr><th>").append(label).append("</th><td>").append(value).append("</td></tr>");
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String hours(List<Integer> hours) {
        if (hours == null || hours.isEmpty()) {
            return "-";
        }
        StringBuilder out = new StringBuilder();
        for (Integer hour : hours) {
            if (out.length() > 0) {
                out.append(", ");
            }
            out.append(String.format(Locale.ROOT, "%02d:00", hour));
        }
        return out.toString();
    }

    private static String counts(Map<String, Long> counts) {
        if (counts == null || counts.isEmpty()) {
            return "-";
        }
        StringBuilder out = new StringBuilder();
        counts.forEach((key, value) -> {
            if (out.length() > 0) {
                out.append(", ");
            }
            out.append(key).append(" (").append(value).append(')');
        });
        return out.toString();
    }

    private static String facts(Map<String, String> facts) {
        if (facts == null || facts.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        facts.forEach((key, value) -> {
            if (out.length() > 0) {
                out.append("; ");
            }
            out.append(key).append('=').append(value);
        });
        return out.toString();
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    @Override
    public String getContentType() {
        return "text/html; charset=UTF-8";
    }
}
