package ai.msf.roundtrip.pages;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Source-PDF page of a function. {@code confidence} is set when the mapping came from automatic extraction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageMapping(String functionId, int pageNumber, Double confidence) {
}
