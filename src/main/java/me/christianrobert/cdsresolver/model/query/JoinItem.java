package me.christianrobert.cdsresolver.model.query;

import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.expr.Expression;

import java.util.ArrayList;
import java.util.List;

public class JoinItem extends FromItem {
    private final String joinType;
    private final List<FromItem> args;
    private final Expression on;

    public JoinItem(String joinType, List<? extends FromItem> args, Expression on, Location location) {
        super(location);
        this.joinType = joinType;
        this.args = new ArrayList<>(args);
        this.on = on;
    }

    public String getJoinType() { return joinType; }
    public List<FromItem> getArgs() { return args; }
    public Expression getOn() { return on; }
}
