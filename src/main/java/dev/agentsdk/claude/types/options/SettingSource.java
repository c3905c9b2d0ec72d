package dev.agentsdk.claude.types.options;

/**
 * Settings files the CLI loads.
 */
public enum SettingSource {
    USER("user"),
    PROJECT("project"),
    LOCAL("local");

    private final String value;

    SettingSource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
