package me.christianrobert.cdsresolver.model.query;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Reference;

/**
 * A path or a sub query in FROM, with its (explicit or implicit) alias.
 */
public class TableRef extends FromItem {
    private final Reference ref;
    private final Query subQuery;
    private final String explicitAlias;
    private Artifact alias;

    public TableRef(Reference ref, String explicitAlias, Location location) {
        super(location);
        this.ref = ref;
        this.subQuery = null;
        this.explicitAlias = explicitAlias;
    }

    public TableRef(Query subQuery, String explicitAlias, Location location) {
        super(location);
        this.ref = null;
        this.subQuery = subQuery;
        this.explicitAlias = explicitAlias;
    }

    public Reference getRef() { return ref; }
    public Query getSubQuery() { return subQuery; }
    public String getExplicitAlias() { return explicitAlias; }
    public Artifact getAlias() { return alias; }
    public void setAlias(Artifact alias) { this.alias = alias; }

    /** Alias name: explicit, or the last name segment of the path. */
    public String aliasName() {
        if (explicitAlias != null) {
            return explicitAlias;
        }
        if (ref == null || ref.getPath().isEmpty()) {
            return null;
        }
        String last = ref.last().getId();
        int dot = last.lastIndexOf('.');
        return dot < 0 ? last : last.substring(dot + 1);
    }
}
