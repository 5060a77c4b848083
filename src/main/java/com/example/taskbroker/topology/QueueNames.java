package com.example.taskbroker.topology;

import java.util.List;

import lombok.Value;

/**
 * 一个逻辑队列对应的三个物理队列名
 */
@Value
public class QueueNames {

    /** 主队列 */
    String canonical;

    /** 延迟队列（canonical + ".DQ"） */
    String delayed;

    /** 死信队列（canonical + ".XQ"） */
    String deadLetter;

    /**
     * 按 主队列、延迟队列、死信队列 的顺序返回
     */
    public List<String> asList() {
        return List.of(canonical, delayed, deadLetter);
    }
}
