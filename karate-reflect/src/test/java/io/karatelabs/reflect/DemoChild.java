package io.karatelabs.reflect;

public class DemoChild {

    private String label;
    private long size;

    public DemoChild() {

    }

    public DemoChild(String label, long size) {
        this.label = label;
        this.size = size;
    }

    public String getLabel() {
        return label;
    }

    public long getSize() {
        return size;
    }

}
