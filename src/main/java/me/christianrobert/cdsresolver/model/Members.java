package me.christianrobert.cdsresolver.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Creation of members and their names.
 */
public final class Members {

    private Members() {
    }

    /**
     * Sets parent, main and the name projections of {@code member}, and adds
     * it to {@code dict} (if given) under {@code id}.
     */
    public static void setMemberParent(Artifact member, String id, Artifact parent, Map<String, Artifact> dict) {
        if (dict != null) {
            dict.put(id, member);
        }
        Artifact owner = parent.getOuter() != null ? parent.getOuter() : parent;
        member.setParent(owner);
        member.setMain(owner.getMain() != null ? owner.getMain() : owner);
        Name name = member.getName();
        Name parentName = owner.getName();
        name.setAbsolute(member.getMain().getName().getAbsolute());
        if (id == null) {
            return;
        }
        String category = member.getKind().nameCategory();
        name.setElement(nameFor("element", category, parentName.getElement(), id));
        name.setAlias("alias".equals(category) ? id : parentName.getAlias());
        name.setParam(nameFor("param", category, parentName.getParam(), id));
        name.setAction(nameFor("action", category, parentName.getAction(), id));
        if (!"select".equals(category)) {
            name.setSelect(parentName.getSelect());
        }
    }

    private static String nameFor(String kind, String category, String parentValue, String id) {
        if (kind.equals(category)) {
            return parentValue != null ? parentValue + "." + id : id;
        }
        return parentValue;
    }

    /**
     * Creates a member {@code id} of {@code parent} derived from {@code origin}:
     * same kind, origin link and a dependency to the origin (silent if requested).
     */
    public static Artifact linkToOrigin(Model model, Artifact origin, String id, Artifact parent,
                                        Map<String, Artifact> dict, Location location, boolean silentDep) {
        Location loc = location != null ? location : origin.getName().getLocation();
        Artifact member = new Artifact(origin.getKind(), new Name(id, loc),
                location != null ? location : origin.getLocation());
        if (origin.getName().isInferred()) {
            member.getName().setInferred(true);
        }
        if (parent != null) {
            setMemberParent(member, id, parent, dict);
        }
        model.register(member);
        model.getLinks().setOrigin(member, origin);
        if (silentDep) {
            model.getLinks().dependsOnSilent(member, origin);
        } else {
            model.getLinks().dependsOn(member, origin, location);
        }
        return member;
    }

    /**
     * Calls {@code callback} for the direct members of {@code construct}: the
     * elements, enum values and foreign keys of its (innermost) items, its
     * actions, params and return type.
     */
    public static void forEachMember(Artifact construct, Consumer<Artifact> callback) {
        Artifact obj = construct;
        while (obj.getItems() != null) {
            obj = obj.getItems();
        }
        List<Artifact> members = new ArrayList<>();
        addAll(members, obj.getElements());
        addAll(members, obj.getEnumValues());
        addAll(members, obj.getForeignKeys());
        addAll(members, construct.getActions());
        addAll(members, construct.getParams());
        if (construct.getReturns() != null) {
            members.add(construct.getReturns());
        }
        members.forEach(callback);
    }

    private static void addAll(List<Artifact> members, Map<String, Artifact> dict) {
        if (dict != null) {
            members.addAll(dict.values());
        }
    }
}
