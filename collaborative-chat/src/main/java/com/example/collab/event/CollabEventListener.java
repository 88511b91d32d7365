package com.example.collab.event;

public interface CollabEventListener {

    void onCollabEvent(CollabEvent event);
}
