// file: storage/src/main/java/io/scoreledger/storage/dto/StatusDocument.java
package io.scoreledger.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusDocument {
    @JsonProperty("updated_at")
    public String updatedAt;

    /** board id -> last run of that board. */
    @JsonProperty("boards")
    public Map<String, BoardStatus> boards = new LinkedHashMap<>();
}
