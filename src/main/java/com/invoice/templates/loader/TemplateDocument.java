package com.invoice.templates.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Raw shape of a YAML template document. Unknown keys are ignored so that
 * newer documents still load on older engines.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDocument {

    private Header template;

    private Issuer issuer;

    private LinkedHashMap<String, Field> fields;

    private LinkedHashMap<String, Table> tables;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Header {
        private String name;
        private String locale;
        private Integer priority;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Issuer {
        private String name;
        private List<String> keywords = new ArrayList<>();

        @JsonProperty("fiscal_id")
        private String fiscalId;

        @JsonProperty("exclude_keywords")
        private List<String> excludeKeywords = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Field {
        private List<String> patterns = new ArrayList<>();
        private Integer group;
        private boolean required;
        private String type;
        private String format;
        private String validator;
        private boolean total;
        private String fallback;

        @JsonProperty("context_keywords")
        private List<String> contextKeywords = new ArrayList<>();

        @JsonProperty("context_range")
        private Integer contextRange;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Table {
        private String start;
        private String end;
        private List<String> skip = new ArrayList<>();
        private List<Column> columns = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Column {
        private String name;
        private String pattern;
    }
}
