package com.vtb.nessus.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReportBundleTest {

    @Test
    void pdfBytesCannotBeModifiedFromOutside() {
        byte[] source = {'%', 'P', 'D', 'F'};
        ReportBundle bundle = ReportBundle.builder().reportId("id").pdfBytes(source).build();

        source[0] = 'X';
        assertEquals('%', bundle.getPdfBytes()[0], "Изменение исходного массива не влияет на bundle");

        bundle.getPdfBytes()[1] = 'X';
        assertEquals('P', bundle.getPdfBytes()[1], "Полученная копия не влияет на bundle");
    }

    @Test
    void missingPdfStaysNull() {
        assertNull(ReportBundle.builder().reportId("id").build().getPdfBytes());
    }
}
