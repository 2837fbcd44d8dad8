package com.xapdoc.service;

/**
 * Thrown when the section order names a section that has no text.
 */
public class MissingSectionException extends DocumentAssemblyException {

    private final String sectionKey;

    /**
     * Create a new exception.
     *
     * @param sectionKey section named in the order but not defined
     */
    public MissingSectionException(String sectionKey) {
        super("Documentation section '" + sectionKey + "' is listed in the order but not defined");
        this.sectionKey = sectionKey;
    }

    public String getSectionKey() {
        return sectionKey;
    }
}
