package com.example.governance.recovery;

public enum PrerequisiteType {
    SYSTEM_CHECK,
    DEPENDENCY_CHECK,
    RESOURCE_CHECK,
    PERMISSION_CHECK
}
