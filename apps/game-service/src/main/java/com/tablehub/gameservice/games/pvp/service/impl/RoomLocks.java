package com.tablehub.gameservice.games.pvp.service.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 每房间一把进程内排他锁。
 * 锁内开启并提交事务，释放锁时写入已提交；afterCommit 在提交之后、释锁之前执行（用于会话发放 / 吊销）。
 */
@Component
@RequiredArgsConstructor
public class RoomLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final TransactionTemplate transactionTemplate;

    public <T> T inRoom(String roomId, Supplier<T> work) {
        return inRoom(roomId, work, Function.identity());
    }

    public <T, R> R inRoom(String roomId, Supplier<T> work, Function<T, R> afterCommit) {
        ReentrantLock lock = locks.computeIfAbsent(roomId, k -> new ReentrantLock());
        lock.lock();
        try {
            T committed = transactionTemplate.execute(status -> work.get());
            return afterCommit.apply(committed);
        } finally {
            lock.unlock();
        }
    }
}
