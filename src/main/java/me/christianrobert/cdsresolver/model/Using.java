package me.christianrobert.cdsresolver.model;

/**
 * A {@code using X.Y as Z} declaration of a source.
 */
public class Using {
    private final Reference extern;
    private final String alias;
    private final Location location;
    // the source the using was resolved against by module resolution, if any
    private Source fileDep;
    private Artifact proxy;

    public Using(Reference extern, String alias, Location location) {
        this.extern = extern;
        this.alias = alias != null ? alias : Name.lastSegment(extern.pathName());
        this.location = location;
    }

    public Reference getExtern() { return extern; }
    public String getAlias() { return alias; }
    public Location getLocation() { return location; }
    public Source getFileDep() { return fileDep; }
    public Artifact getProxy() { return proxy; }

    public void setFileDep(Source fileDep) { this.fileDep = fileDep; }
    public void setProxy(Artifact proxy) { this.proxy = proxy; }
}
