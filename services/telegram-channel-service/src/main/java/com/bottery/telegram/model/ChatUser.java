package com.bottery.telegram.model;

/** Sender of a {@link Message}, as far as the platform-neutral side needs to know it. */
public interface ChatUser {

  long id();
}
