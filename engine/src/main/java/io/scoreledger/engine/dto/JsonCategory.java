// file: engine/src/main/java/io/scoreledger/engine/dto/JsonCategory.java
package io.scoreledger.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonCategory {
    public String key;
    public double weight;
    public List<JsonSource> sources;
}
