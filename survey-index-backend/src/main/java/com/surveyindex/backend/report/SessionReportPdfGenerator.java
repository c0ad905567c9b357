package com.surveyindex.backend.report;

import com.lowagie.text.*;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;

import com.surveyindex.backend.dto.HistoryEntry;
import com.surveyindex.backend.error.ReportGenerationException;
import com.surveyindex.backend.evaluation.SessionQualityBreakdown;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Locale;

public class SessionReportPdfGenerator {

    private final String title;

    public SessionReportPdfGenerator(String title) {
        this.title = title;
    }

    public byte[] generatePdf(String userId, String sessionId,
                              List<HistoryEntry> history, SessionQualityBreakdown quality) {

        Document document = new Document();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        try {
            PdfWriter.getInstance(document, out);
            document.open();

            Font titleFont = new Font(Font.HELVETICA, 18, Font.BOLD);
            Font bodyFont = new Font(Font.HELVETICA, 12);

            document.add(new Paragraph(title, titleFont));
            document.add(new Paragraph(" "));
            document.add(new Paragraph("Respondent: " + userId, bodyFont));
            document.add(new Paragraph("Session: " + sessionId, bodyFont));
            document.add(new Paragraph("Questions scored: " + quality.entryCount, bodyFont));
            document.add(new Paragraph(" "));

            if (!history.isEmpty()) {
                PdfPTable table = new PdfPTable(4);
                table.setWidthPercentage(100);
                table.addCell("Question");
                table.addCell("Timestamp");
                table.addCell("SCI");
                table.addCell("UEI");
                for (HistoryEntry e : history) {
                    table.addCell(e.getQuestionId());
                    table.addCell(e.getTimestamp());
                    table.addCell(format(e.getSci()));
                    table.addCell(format(e.getUei()));
                }
                document.add(table);
                document.add(new Paragraph(" "));
            }

            document.add(new Paragraph("Mean UEI: " + format(quality.meanUei), bodyFont));
            document.add(new Paragraph("Mean SCI: " + format(quality.meanSci), bodyFont));
            document.add(new Paragraph("Consistency: " + format(quality.consistency), bodyFont));
            document.add(new Paragraph("High engagement ratio: " + format(quality.highEngagementRatio), bodyFont));
            document.add(new Paragraph("Low engagement ratio: " + format(quality.lowEngagementRatio), bodyFont));
            document.add(new Paragraph("Engaged despite conflict: " + format(quality.balanceRatio), bodyFont));
            document.add(new Paragraph(" "));

            document.add(new Paragraph(
                    "SESSION ENGAGEMENT INDEX: " + format(quality.sei),
                    new Font(Font.HELVETICA, 14, Font.BOLD)
            ));

            document.close();

        } catch (DocumentException e) {
            throw new ReportGenerationException("Could not render session report for " + userId, e);
        }

        return out.toByteArray();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
