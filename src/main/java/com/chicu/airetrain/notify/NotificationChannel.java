package com.chicu.airetrain.notify;

public interface NotificationChannel {

    String name();

    void send(NotificationEvent event);
}
