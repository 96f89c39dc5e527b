package com.sanguo.engine.choice;

public enum ChoiceType {
    SELECT_TARGETS,
    SELECT_CARDS,
    CONFIRM,
    SELECT_OPTION
}
