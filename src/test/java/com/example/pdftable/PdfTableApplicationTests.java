package com.example.pdftable;

import com.example.pdftable.application.service.PdfTableService;
import com.example.pdftable.config.TableExtractionProperties;
import com.example.pdftable.domain.model.RowBuildMode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class PdfTableApplicationTests {

    @Autowired
    private PdfTableService pdfTableService;

    @Autowired
    private TableExtractionProperties properties;

    /**
     * Ensures the application context loads and binds the default tolerances.
     */
    @Test
    void contextLoads() {
        assertThat(pdfTableService).isNotNull();
        assertThat(properties.getMode()).isEqualTo(RowBuildMode.BASIC);
        assertThat(properties.getColumnRowThreshold()).isEqualTo(8f);
        assertThat(properties.getMergeGapTolerance()).isEqualTo(10f);
    }
}
