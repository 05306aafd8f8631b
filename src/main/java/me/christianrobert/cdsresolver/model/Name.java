package me.christianrobert.cdsresolver.model;

/**
 * The name projections of a node: absolute name of the main artifact, local
 * id and the member paths per member category.
 */
public class Name {
    private String id;
    private String absolute;
    private String element;
    private String alias;
    private Integer select;
    private String param;
    private String action;
    private Location location;
    private boolean inferred;

    public Name(String id, Location location) {
        this.id = id;
        this.location = location;
    }

    public static Name absolute(String absolute, Location location) {
        Name name = new Name(lastSegment(absolute), location);
        name.setAbsolute(absolute);
        return name;
    }

    public static String lastSegment(String dotted) {
        int dot = dotted.lastIndexOf('.');
        return dot < 0 ? dotted : dotted.substring(dot + 1);
    }

    public String getId() { return id; }
    public String getAbsolute() { return absolute; }
    public String getElement() { return element; }
    public String getAlias() { return alias; }
    public Integer getSelect() { return select; }
    public String getParam() { return param; }
    public String getAction() { return action; }
    public Location getLocation() { return location; }
    public boolean isInferred() { return inferred; }

    public void setId(String id) { this.id = id; }
    public void setAbsolute(String absolute) { this.absolute = absolute; }
    public void setElement(String element) { this.element = element; }
    public void setAlias(String alias) { this.alias = alias; }
    public void setSelect(Integer select) { this.select = select; }
    public void setParam(String param) { this.param = param; }
    public void setAction(String action) { this.action = action; }
    public void setLocation(Location location) { this.location = location; }
    public void setInferred(boolean inferred) { this.inferred = inferred; }

    /**
     * Human readable name as used in messages, e.g. {@code S.E:a.b}.
     */
    public String display() {
        StringBuilder sb = new StringBuilder(absolute != null ? absolute : String.valueOf(id));
        if (action != null) {
            sb.append(':').append(action);
        }
        if (param != null) {
            sb.append(action != null ? "(" : ":").append(param);
            if (action != null) {
                sb.append(')');
            }
        }
        if (element != null) {
            sb.append(action != null || param != null ? "." : ":").append(element);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return display();
    }
}
