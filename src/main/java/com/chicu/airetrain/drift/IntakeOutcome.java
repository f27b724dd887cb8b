package com.chicu.airetrain.drift;

public enum IntakeOutcome {
    /** Создана новая заявка */
    ACCEPTED,
    /** Склеено с уже висящей заявкой */
    COALESCED,
    /** Ниже порога severity */
    IGNORED,
    /** Отброшено: cooldown / очередь полна / target заморожен */
    DROPPED
}
