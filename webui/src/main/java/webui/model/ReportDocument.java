package webui.model;

import report.ReportFormat;

/**
 * Сформированный отчет для выгрузки: содержимое, формат и имя файла.
 */
public record ReportDocument(
    byte[] content,
    ReportFormat format,
    String fileName
) {
    public static ReportDocument of(String sessionId, ReportFormat format, byte[] content) {
        return new ReportDocument(content, format,
            "code_review_report_" + sessionId + "." + format.getExtension());
    }

    public String contentType() {
        return format.getContentType();
    }
}
