// file: engine/src/main/java/io/scoreledger/engine/dto/JsonSource.java
package io.scoreledger.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonSource {
    public String id;
    public boolean lowerIsBetter;
}
