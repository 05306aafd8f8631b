package me.christianrobert.cdsresolver.model.query;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.LexicalBlock;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A SELECT: FROM clause, columns and the other clauses.  After linking it
 * owns its table aliases (including mixins and {@code $self}); after
 * population its {@code result} artifact holds the inferred elements and
 * {@code combined} all elements visible from the sources.
 */
public class SelectQuery extends Query implements LexicalBlock {
    private FromItem from;
    private List<Artifact> columns;                 // null: implicit "*"
    private boolean distinct;
    private LinkedHashMap<String, Location> excluding;
    private LinkedHashMap<String, Artifact> mixins;
    private Expression where;
    private Expression having;
    private final List<Expression> groupBy = new ArrayList<>();
    private final List<Expression> orderBy = new ArrayList<>();

    // Set by the linker
    private int number;
    private LexicalBlock lexicalNext;
    private Artifact result;
    private final LinkedHashMap<String, Artifact> tableAliases = new LinkedHashMap<>();

    // Set when populated
    private LinkedHashMap<String, List<Artifact>> combined;
    private final List<Artifact> inlines = new ArrayList<>();

    public SelectQuery(FromItem from, List<Artifact> columns, Location location) {
        super(location);
        this.from = from;
        this.columns = columns;
    }

    @Override
    public SelectQuery leading() {
        return this;
    }

    @Override
    public Map<String, Artifact> getLexicalNames() {
        return Collections.unmodifiableMap(tableAliases);
    }

    @Override
    public LexicalBlock getOuterBlock() {
        return lexicalNext;
    }

    public boolean isPopulated() {
        return combined != null;
    }

    public FromItem getFrom() { return from; }
    public List<Artifact> getColumns() { return columns; }
    public boolean isDistinct() { return distinct; }
    public LinkedHashMap<String, Location> getExcluding() { return excluding; }
    public LinkedHashMap<String, Artifact> getMixins() { return mixins; }
    public Expression getWhere() { return where; }
    public Expression getHaving() { return having; }
    public List<Expression> getGroupBy() { return groupBy; }
    public List<Expression> getOrderBy() { return orderBy; }
    public int getNumber() { return number; }
    public LexicalBlock getLexicalNext() { return lexicalNext; }
    public Artifact getResult() { return result; }
    public LinkedHashMap<String, Artifact> getTableAliases() { return tableAliases; }
    public LinkedHashMap<String, List<Artifact>> getCombined() { return combined; }
    public List<Artifact> getInlines() { return inlines; }

    public void setFrom(FromItem from) { this.from = from; }
    public void setColumns(List<Artifact> columns) { this.columns = columns; }
    public void setDistinct(boolean distinct) { this.distinct = distinct; }
    public void setExcluding(LinkedHashMap<String, Location> excluding) { this.excluding = excluding; }
    public void setMixins(LinkedHashMap<String, Artifact> mixins) { this.mixins = mixins; }
    public void setWhere(Expression where) { this.where = where; }
    public void setHaving(Expression having) { this.having = having; }
    public void setNumber(int number) { this.number = number; }
    public void setLexicalNext(LexicalBlock lexicalNext) { this.lexicalNext = lexicalNext; }
    public void setResult(Artifact result) { this.result = result; }
    public void setCombined(LinkedHashMap<String, List<Artifact>> combined) { this.combined = combined; }
}
