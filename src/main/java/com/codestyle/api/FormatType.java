package com.codestyle.api;

public enum FormatType {
    WHITESPACE,
    CODE_STYLE
}
