package com.challenges.lsparse.parser;

/**
 * Grammar rules that can be used as the start symbol of a parse.
 */
public enum Rule {
    CONFIG,
    PLUGIN_SECTION,
    PLUGIN,
    ATTRIBUTE,
    BRANCH,
    CONDITION,
    EXPRESSION,
    RVALUE,
    VALUE,
    ARRAY,
    HASH,
    HASH_KEY,
    NAME,
    STRING,
    NUMBER,
    BAREWORD,
    SELECTOR,
    REGEXP,
    METHOD_CALL,
    BOOLEAN
}
