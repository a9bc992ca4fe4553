package com.challenges.lsparse.ast;

public enum SectionType {
    INPUT("input"),
    FILTER("filter"),
    OUTPUT("output");

    private final String keyword;

    SectionType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static SectionType fromKeyword(String keyword) {
        for (SectionType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown plugin section: " + keyword);
    }
}
