package com.example.pdftable.config;

import com.example.pdftable.application.table.TableGeometry;
import com.example.pdftable.domain.model.RowBuildMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests binding and startup validation of the {@code table-extraction.*} settings.
 */
class TableExtractionPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void bindsConfiguredTolerances() {
        contextRunner
                .withPropertyValues(
                        "table-extraction.mode=column-exact",
                        "table-extraction.column-row-threshold=12",
                        "table-extraction.layout-failure-policy=SKIP_PAGE")
                .run(context -> {
                    TableExtractionProperties properties = context.getBean(TableExtractionProperties.class);
                    assertThat(properties.getMode()).isEqualTo(RowBuildMode.COLUMN_EXACT);
                    assertThat(properties.getLayoutFailurePolicy())
                            .isEqualTo(TableExtractionProperties.LayoutFailurePolicy.SKIP_PAGE);
                    assertThat(properties.toGeometry()).isEqualTo(new TableGeometry(5f, 12f, 5f, 10f));
                });
    }

    /**
     * A negative tolerance must fail the context instead of every later request.
     */
    @Test
    void negativeToleranceFailsAtStartup() {
        contextRunner
                .withPropertyValues("table-extraction.merge-gap-tolerance=-1")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(IllegalArgumentException.class)
                            .rootCause()
                            .hasMessageContaining("mergeGapTolerance");
                });
    }

    @Test
    void negativeJoinGapFailsAtStartup() {
        contextRunner
                .withPropertyValues("table-extraction.fragment-join-gap=-0.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(TableExtractionProperties.class)
    static class PropertiesConfiguration {
    }
}
