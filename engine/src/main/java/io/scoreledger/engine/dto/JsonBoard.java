// file: engine/src/main/java/io/scoreledger/engine/dto/JsonBoard.java
package io.scoreledger.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonBoard {
    public String id;
    public String ledger;
    public int qualificationMin;
    public String qualificationMode;
    public Integer minDiscoverySources;
    public Double dampenerBase;
    public List<JsonCategory> categories;
}
