package me.christianrobert.cdsresolver.diagnostics;

import me.christianrobert.cdsresolver.model.Location;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One entry of the diagnostics stream.
 */
public class Diagnostic {

    private final String id;
    private final Severity severity;
    private final Location location;
    private final String home;
    private final String message;
    private final Map<String, Object> args;
    private List<String> validNames = Collections.emptyList();

    public Diagnostic(String id, Severity severity, Location location, String home,
                      String message, Map<String, Object> args) {
        this.id = id;
        this.severity = severity;
        this.location = location;
        this.home = home;
        this.message = message;
        this.args = args != null ? Collections.unmodifiableMap(args) : Collections.emptyMap();
    }

    public String getId() {
        return id;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Location getLocation() {
        return location;
    }

    /**
     * Semantic location, e.g. {@code entity:“S.E”/element:“x”}; may be null.
     */
    public String getHome() {
        return home;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public List<String> getValidNames() {
        return validNames;
    }

    public void setValidNames(List<String> validNames) {
        this.validNames = validNames != null ? validNames : Collections.emptyList();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (location != null) {
            sb.append(location).append(": ");
        }
        sb.append(severity.getLabel());
        if (id != null) {
            sb.append(" ").append(id);
        }
        sb.append(": ").append(message);
        if (home != null) {
            sb.append(" (in ").append(home).append(")");
        }
        return sb.toString();
    }
}
