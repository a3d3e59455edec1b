package com.weft.discovery;

/** How a candidate was found: through an indexed goal fragment, or by keyword search over plugin text. */
public enum MatchType {
    DIRECT,
    FUZZY
}
