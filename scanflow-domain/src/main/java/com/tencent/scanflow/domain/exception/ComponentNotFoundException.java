package com.tencent.scanflow.domain.exception;

public class ComponentNotFoundException extends PlanningException {

    private final String componentType;

    public ComponentNotFoundException(String componentType, String message) {
        super(ErrorCode.COMPONENT_NOT_FOUND, message);
        this.componentType = componentType;
    }

    public String getComponentType() {
        return componentType;
    }
}
