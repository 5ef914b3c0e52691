// file: storage/src/main/java/io/scoreledger/storage/dto/ModelDocument.java
package io.scoreledger.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelDocument {
    @JsonProperty("name")
    public String name;

    @JsonProperty("company")
    public String company;

    @JsonProperty("rank")
    public Integer rank;

    /** Aligned with the ledger's dates; null entries are absent scores. */
    @JsonProperty("scores")
    public List<Double> scores;

    @JsonProperty("qualifying_categories")
    public int qualifyingCategories;

    @JsonProperty("source_count")
    public int sourceCount;

    @JsonProperty("category_values")
    public Map<String, Double> categoryValues;
}
