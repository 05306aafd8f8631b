package me.christianrobert.cdsresolver;

import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.AnnotationPriority;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Cardinality;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.FromItem;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builders for parsed models as the parser would deliver them: flat
 * definitions with absolute names per source, plain member dictionaries.
 */
public final class TestModels {

    private static int line;

    private TestModels() {
    }

    /** A fresh location; every call returns a new object on a new line. */
    public static Location loc() {
        return new Location("test.cds", ++line, 1);
    }

    public static Model model(Source... sources) {
        Model model = new Model();
        for (Source source : sources) {
            model.getSources().add(source);
        }
        return model;
    }

    public static Source source(String realname, Artifact... definitions) {
        Source source = new Source(realname);
        for (Artifact definition : definitions) {
            source.getDefinitions().add(definition);
        }
        return source;
    }

    public static Artifact entity(String absolute, Artifact... elements) {
        return definition(Kind.ENTITY, absolute, elements);
    }

    public static Artifact type(String absolute, String typeName) {
        Artifact type = Artifact.definition(Kind.TYPE, absolute, loc());
        type.setType(Reference.of(typeName, loc()));
        return type;
    }

    public static Artifact definition(Kind kind, String absolute, Artifact... elements) {
        Artifact art = Artifact.definition(kind, absolute, loc());
        for (Artifact element : elements) {
            art.ensureElements().put(element.getName().getId(), element);
        }
        return art;
    }

    public static Artifact element(String id, String typeName) {
        Artifact element = Artifact.member(Kind.ELEMENT, id, loc());
        if (typeName != null) {
            element.setType(Reference.of(typeName, loc()));
        }
        return element;
    }

    public static Artifact key(String id, String typeName) {
        Artifact element = element(id, typeName);
        element.setKey(Boolean.TRUE);
        return element;
    }

    /** {@code entity <absolute> as select from <from>;} with implicit wildcard. */
    public static Artifact view(String absolute, String from) {
        Artifact view = Artifact.definition(Kind.ENTITY, absolute, loc());
        TableRef tableRef = new TableRef(Reference.of(from, loc()), null, loc());
        view.setQuery(new SelectQuery(tableRef, null, loc()));
        return view;
    }

    /** {@code entity <absolute> as select from <from> { <columns> };} */
    public static Artifact select(String absolute, FromItem from, Artifact... columns) {
        Artifact view = Artifact.definition(Kind.ENTITY, absolute, loc());
        view.setQuery(new SelectQuery(from, new ArrayList<>(Arrays.asList(columns)), loc()));
        return view;
    }

    public static TableRef from(String path) {
        return new TableRef(Reference.of(path, loc()), null, loc());
    }

    /** A column with a path value; the element name is inferred from the last step. */
    public static Artifact column(String path) {
        Artifact column = new Artifact(Kind.ELEMENT, null, loc());
        column.setValue(new PathExpression(Reference.of(path, loc()), loc()));
        return column;
    }

    public static Artifact wildcard() {
        Artifact column = new Artifact(Kind.ELEMENT, null, loc());
        column.setWildcard(true);
        return column;
    }

    /** {@code <id>: Association to <target>;} */
    public static Artifact association(String id, String target) {
        Artifact element = element(id, "cds.Association");
        element.setTarget(Reference.of(target, loc()));
        return element;
    }

    /** {@code <id>: Association to many <target>;} */
    public static Artifact toMany(String id, String target) {
        Artifact element = association(id, target);
        element.setCardinality(Cardinality.toMany(loc()));
        return element;
    }

    public static AnnotationAssignment anno(String name, Expression value, Source source,
                                            AnnotationPriority priority) {
        AnnotationAssignment assignment = new AnnotationAssignment(name, value, loc());
        assignment.setSource(source);
        assignment.setPriority(priority);
        return assignment;
    }

    public static List<String> ids(List<Artifact> nodes) {
        return nodes.stream().map(a -> a.getName().getId()).collect(Collectors.toList());
    }
}
