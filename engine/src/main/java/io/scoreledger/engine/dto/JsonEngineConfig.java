// file: engine/src/main/java/io/scoreledger/engine/dto/JsonEngineConfig.java
package io.scoreledger.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonEngineConfig {
    public String aliasVersion;
    public String aliasFile;
    public Map<String, String> aliases;
    public String groupFile;
    public Map<String, String> groups;
    public String statusFile;
    public Integer summaryTopN;
    public List<JsonBoard> boards;
}
