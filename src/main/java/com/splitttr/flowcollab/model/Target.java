package com.splitttr.flowcollab.model;

public record Target(TargetKind kind, String id) {

    public static Target node(String id) {
        return new Target(TargetKind.NODE, id);
    }

    public static Target edge(String id) {
        return new Target(TargetKind.EDGE, id);
    }

    public static Target workflow(String id) {
        return new Target(TargetKind.WORKFLOW, id);
    }
}
