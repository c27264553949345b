package com.menuassist.chat.service.config;

import java.util.List;

public class InvalidConfigException extends RuntimeException {

    private final List<String> violations;

    public InvalidConfigException(List<String> violations) {
        super("Invalid assistant configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
