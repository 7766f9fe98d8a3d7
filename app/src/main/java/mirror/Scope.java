package mirror;

import java.util.Locale;

// Which URLs count as part of the mirrored site.
public enum Scope {
    SAME_ORIGIN("same-origin"),
    SAME_HOST_SUBDOMAINS("same-host-subdomains");

    private final String cliName;

    Scope(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public static Scope fromCliName(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (Scope scope : values()) {
            if (scope.cliName.equals(s)) return scope;
        }
        throw new IllegalArgumentException("Unknown scope: " + raw + " (use same-origin or same-host-subdomains)");
    }
}
