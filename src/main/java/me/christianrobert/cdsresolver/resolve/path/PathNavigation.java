package me.christianrobert.cdsresolver.resolve.path;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.LinkTable;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;

import java.util.List;

/**
 * What the head of a resolved value path navigates: a source element of a
 * table alias, a mixin, or {@code $self}.
 */
public final class PathNavigation {

    private static final PathNavigation NONE = new PathNavigation(null, null, null);

    private final Artifact navigation;
    private final PathStep item;
    private final Artifact tableAlias;

    private PathNavigation(Artifact navigation, PathStep item, Artifact tableAlias) {
        this.navigation = navigation;
        this.item = item;
        this.tableAlias = tableAlias;
    }

    /**
     * Navigation of a resolved reference; nothing for unresolved references
     * and references not starting at a table alias, mixin or {@code $self}.
     */
    public static PathNavigation of(Reference ref) {
        if (ref == null || ref.getArtifact() == null || ref.getPath().isEmpty()) {
            return NONE;
        }
        List<PathStep> path = ref.getPath();
        PathStep head = path.get(0);
        Artifact root = head.getNavigation();
        if (root == null) {
            return NONE;
        }
        switch (root.getKind()) {
            case NAV_ELEMENT:
                return new PathNavigation(root, head, root.getParent());
            case MIXIN:
                return new PathNavigation(root, head, null);
            case SELF:
                return new PathNavigation(null, path.size() > 1 ? path.get(1) : null, root);
            case TABLE_ALIAS:
                if (path.size() < 2) {
                    return NONE;
                }
                PathStep second = path.get(1);
                Artifact navElement = root.getElements() != null ? root.getElements().get(second.getId()) : null;
                return new PathNavigation(navElement, second, root);
            default:
                return NONE;
        }
    }

    /**
     * The query element projecting {@code navigation}: {@code preferred} if
     * it is one of its projections, otherwise the first; {@code null} if the
     * element is not projected.
     */
    public static Artifact navProjection(LinkTable links, Artifact navigation, Artifact preferred) {
        if (navigation == null) {
            return null;
        }
        List<Artifact> projections = links.projections(navigation);
        if (projections.isEmpty()) {
            return null;
        }
        if (preferred != null && projections.contains(preferred)) {
            return preferred;
        }
        return projections.get(0);
    }

    public boolean isEmpty() {
        return navigation == null && item == null && tableAlias == null;
    }

    public Artifact getNavigation() { return navigation; }
    public PathStep getItem() { return item; }
    public Artifact getTableAlias() { return tableAlias; }

    public boolean isSelf() {
        return tableAlias != null && tableAlias.getKind() == Kind.SELF;
    }

    @Override
    public String toString() {
        return "PathNavigation{navigation=" + navigation + ", item=" + item + ", tableAlias=" + tableAlias + "}";
    }
}
