package com.foo.sheets.config;

import jakarta.validation.constraints.Positive;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "sheets.source")
public class SheetSourceProperties {

    private String sheetId = "";
    private String sheetName;
    private String gid;

    @Positive
    private int timeoutSeconds = 10;

    @Positive
    private int connectTimeoutSeconds = 10;

    /** Rows inspected when computing column statistics. */
    @Positive
    private int sampleSize = 1000;

    private List<String> preferredMetricColumns = new ArrayList<>(List.of("Response", "CBR (%)"));
}
