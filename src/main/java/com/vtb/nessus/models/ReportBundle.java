package com.vtb.nessus.models;

import lombok.Builder;
import lombok.Value;

/**
 * Сгенерированные артефакты отчета, хранимые в кэше.
 * PDF копируется при записи и при чтении, кэшированный массив наружу не отдается.
 */
@Value
@Builder
public class ReportBundle {
    String reportId;
    ReportDetails details;
    String html;
    byte[] pdfBytes;

    public byte[] getPdfBytes() {
        return pdfBytes == null ? null : pdfBytes.clone();
    }

    public static class ReportBundleBuilder {
        public ReportBundleBuilder pdfBytes(byte[] pdfBytes) {
            this.pdfBytes = pdfBytes == null ? null : pdfBytes.clone();
            return this;
        }
    }
}
