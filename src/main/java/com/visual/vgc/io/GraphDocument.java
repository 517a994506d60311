package com.visual.vgc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.visual.vgc.api.PinDirection;
import com.visual.vgc.api.PinKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * POJO form of a saved graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDocument {
    private String id, name;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private List<NodeDef> nodes = new ArrayList<>();
    private List<ConnectionDef> connections = new ArrayList<>();
    private List<LibraryDef> externalLibraries = new ArrayList<>();

    /** One node: its template, pins and construction arguments. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id, type;
        private PositionDef position;
        private List<PinDef> pins = new ArrayList<>();
        private String literalTypeName;
        private Object literalValue;
        private MethodDef method;
        private Map<String, Object> properties = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PositionDef {
        private double x, y;
    }

    /** Saved pin identity. Pins are matched on load by name, direction and kind. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PinDef {
        private String id, name;
        private PinDirection direction;
        private PinKind kind;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class MethodDef {
        private String declaringTypeName, methodName;
        private List<String> parameterTypeNames = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionDef {
        private String sourcePinId, targetPinId;
    }

    /** A reference assembly the UI loaded. Carried through untouched. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LibraryDef {
        private String name, filePath;
    }
}
