package com.starscape.memora.features.metadata.domain;

/**
 * One candidate location for a metadata value.
 * 
 * @param source    where the value conventionally comes from
 * @param selector  CSS selector; only the first matching element is inspected
 * @param attribute attribute to read, or null to read the element's text
 */
public record ExtractionRule(
    MetadataSource source,
    String selector,
    String attribute
) {
    
    public static ExtractionRule attr(MetadataSource source, String selector, String attribute) {
        return new ExtractionRule(source, selector, attribute);
    }
    
    public static ExtractionRule text(MetadataSource source, String selector) {
        return new ExtractionRule(source, selector, null);
    }
    
    public boolean readsText() {
        return attribute == null;
    }
}
