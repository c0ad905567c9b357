package com.surveyindex.backend.controller;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.surveyindex.backend.dto.HistoryEntry;
import com.surveyindex.backend.evaluation.SessionQualityBreakdown;
import com.surveyindex.backend.report.SessionReportPdfGenerator;
import com.surveyindex.backend.service.IndexEngine;

import java.util.List;

@RestController
@RequestMapping("/api/indices/report")
public class ReportController {

    private final IndexEngine engine;
    private final SessionReportPdfGenerator pdfGenerator;

    public ReportController(IndexEngine engine, SessionReportPdfGenerator pdfGenerator) {
        this.engine = engine;
        this.pdfGenerator = pdfGenerator;
    }

    @GetMapping("/{userId}/pdf")
    public ResponseEntity<byte[]> downloadPdf(@PathVariable String userId) {

        List<HistoryEntry> history = engine.history(userId);
        SessionQualityBreakdown quality = engine.sessionQuality(userId);

        byte[] pdf = pdfGenerator.generatePdf(
                userId,
                engine.sessionId(),
                history,
                quality
        );

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=Session_Report_" + userId + ".pdf")
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }
}
