package com.example.charging.controllers;

import com.example.charging.dto.QueueEvent;

public interface NotificationEmitter {

    /** Fire-and-forget hand-off to the delivery channel; must not throw on delivery failure */
    void emit(QueueEvent event);
}
