// file: storage/src/main/java/io/scoreledger/storage/dto/LedgerDocument.java
package io.scoreledger.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk shape of a ledger:
 * <pre>
 * {
 *   "dates":    ["2025-03-01", ...],
 *   "models":   [ { see ModelDocument }, ... ],
 *   "checksum": "hex sha-256"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerDocument {
    @JsonProperty("dates")
    public List<String> dates;

    @JsonProperty("models")
    public List<ModelDocument> models;

    @JsonProperty("checksum")
    public String checksum;
}
