package com.messageworks.core.id;

import java.util.UUID;

public class UuidIdGenerator implements IdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
