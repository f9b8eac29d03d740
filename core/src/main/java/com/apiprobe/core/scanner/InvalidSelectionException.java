package com.apiprobe.core.scanner;

import java.util.List;

/** 레지스트리에 없는 프로브 이름이 선택됨. 네트워크 활동 전에 거부한다. */
public class InvalidSelectionException extends IllegalArgumentException {
    private final List<String> unknownNames;
    private final List<String> knownNames;

    public InvalidSelectionException(List<String> unknownNames, List<String> knownNames) {
        super("Unknown probe(s) " + unknownNames + "; registered: " + knownNames);
        this.unknownNames = List.copyOf(unknownNames);
        this.knownNames = List.copyOf(knownNames);
    }

    public List<String> getUnknownNames() { return unknownNames; }
    public List<String> getKnownNames() { return knownNames; }
}
