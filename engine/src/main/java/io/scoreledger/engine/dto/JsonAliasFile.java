// file: engine/src/main/java/io/scoreledger/engine/dto/JsonAliasFile.java
package io.scoreledger.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/** Alias and group files: {"version": "...", "aliases": {...}} and {"groups": {...}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonAliasFile {
    public String version;
    public Map<String, String> aliases;
    public Map<String, String> groups;
}
