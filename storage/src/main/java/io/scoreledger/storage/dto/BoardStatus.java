// file: storage/src/main/java/io/scoreledger/storage/dto/BoardStatus.java
package io.scoreledger.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Last-run record of one board inside status.json. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BoardStatus {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopEntry {
        @JsonProperty("name")
        public String name;

        @JsonProperty("score")
        public Double score;

        public TopEntry() {
        }

        public TopEntry(String name, Double score) {
            this.name = name;
            this.score = score;
        }
    }

    /** ISO-8601 instant the run finished. */
    @JsonProperty("last_run")
    public String lastRun;

    @JsonProperty("run_date")
    public String runDate;

    /** Terminal run state, e.g. PERSISTED, REPORTED, ABORTED. */
    @JsonProperty("state")
    public String state;

    /** "persist" or "dry-run". */
    @JsonProperty("mode")
    public String mode;

    @JsonProperty("qualified")
    public int qualified;

    @JsonProperty("total")
    public int total;

    @JsonProperty("top_entity")
    public String topEntity;

    @JsonProperty("top_score")
    public Double topScore;

    @JsonProperty("top")
    public List<TopEntry> top = new ArrayList<>();

    @JsonProperty("sources_hit")
    public int sourcesHit;

    @JsonProperty("sources_total")
    public int sourcesTotal;

    @JsonProperty("duration_ms")
    public long durationMillis;

    /** Abort reason and message; null on success. */
    @JsonProperty("error")
    public String error;
}
