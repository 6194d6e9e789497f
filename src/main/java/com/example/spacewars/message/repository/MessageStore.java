package com.example.spacewars.message.repository;

import com.example.spacewars.global.persistence.DurableStore;
import com.example.spacewars.message.domain.Inbox;

/**
 * 유저 ID별 인박스 단위로 읽고 쓴다.
 */
public interface MessageStore extends DurableStore<Long, Inbox> {
}
