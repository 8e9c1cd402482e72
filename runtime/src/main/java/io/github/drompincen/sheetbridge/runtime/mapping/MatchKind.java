package io.github.drompincen.sheetbridge.runtime.mapping;

public enum MatchKind { EXACT, FUZZY, UNMAPPED }
