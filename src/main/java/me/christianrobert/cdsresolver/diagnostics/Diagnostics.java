package me.christianrobert.cdsresolver.diagnostics;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The diagnostics stream of one resolve run.
 *
 * <p>Not-found diagnostics are reported at most once per location object, so
 * that on-demand resolution of the same reference never reports twice.
 */
public class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> messages = new ArrayList<>();
    private final Set<Location> notFoundMarked = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<String, Severity> severityOverrides;
    private final boolean attachValidNames;

    public Diagnostics() {
        this(Collections.emptyMap(), false);
    }

    public Diagnostics(Map<String, Severity> severityOverrides, boolean attachValidNames) {
        this.severityOverrides = new HashMap<>(severityOverrides);
        this.attachValidNames = attachValidNames;
    }

    public Diagnostic error(String id, Location location, Artifact home, Map<String, Object> args) {
        return report(Severity.ERROR, id, location, home, args, null);
    }

    public Diagnostic error(String id, Location location, Artifact home, Map<String, Object> args, String text) {
        return report(Severity.ERROR, id, location, home, args, text);
    }

    public Diagnostic warning(String id, Location location, Artifact home, Map<String, Object> args) {
        return report(Severity.WARNING, id, location, home, args, null);
    }

    public Diagnostic info(String id, Location location, Artifact home, Map<String, Object> args) {
        return report(Severity.INFO, id, location, home, args, null);
    }

    /**
     * Reports with the registered severity of the message id; error if none
     * is registered.
     */
    public Diagnostic message(String id, Location location, Artifact home, Map<String, Object> args) {
        return report(null, id, location, home, args, null);
    }

    /**
     * Reports a not-found or ambiguity diagnostic unless one has already been
     * reported for the same location object.
     *
     * @return the new diagnostic, or {@code null} if the location was already marked
     */
    public Diagnostic signalNotFound(String id, Location location, Artifact home, Map<String, Object> args,
                                     Collection<String> validNames) {
        if (location != null && !notFoundMarked.add(location)) {
            return null;
        }
        Diagnostic diagnostic = message(id, location, home, args);
        if (attachValidNames && validNames != null) {
            diagnostic.setValidNames(validNames.stream().sorted().collect(Collectors.toList()));
        }
        return diagnostic;
    }

    /** Marks a location as reported without reporting anything. */
    public void markNotFound(Location location) {
        if (location != null) {
            notFoundMarked.add(location);
        }
    }

    public boolean isNotFoundMarked(Location location) {
        return location != null && notFoundMarked.contains(location);
    }

    /**
     * Creates and records a diagnostic.
     *
     * @param severity severity of the call site, used when the id has no registered severity;
     *                 {@code null} means: registered severity or error
     * @param text     message text (std variant) used when the id has no registered texts
     */
    public Diagnostic report(Severity severity, String id, Location location, Artifact home,
                             Map<String, Object> args, String text) {
        Map<String, Object> params = args != null ? args : MessageArgs.none();
        Severity effective = MessageRegistry.defaultSeverity(id);
        if (effective == null) {
            effective = severity != null ? severity : Severity.ERROR;
        }
        Severity override = id != null ? severityOverrides.get(id) : null;
        if (override != null && effective != Severity.ERROR) {
            effective = override;
        }
        Map<String, String> texts = MessageRegistry.texts(id);
        if (texts.isEmpty() && text != null) {
            texts = Map.of(MessageRegistry.STD, text);
        }
        String rendered = MessageFormatter.format(texts, params);
        Diagnostic diagnostic = new Diagnostic(id, effective, location, MessageNames.homeName(home),
                rendered, params);
        messages.add(diagnostic);
        log.debug("{}", diagnostic);
        return diagnostic;
    }

    public List<Diagnostic> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean hasErrors() {
        return messages.stream().anyMatch(Diagnostic::isError);
    }

    public long count(Severity severity) {
        return messages.stream().filter(m -> m.getSeverity() == severity).count();
    }

    public List<Diagnostic> byId(String id) {
        return messages.stream().filter(m -> id.equals(m.getId())).collect(Collectors.toList());
    }

    public int size() {
        return messages.size();
    }
}
