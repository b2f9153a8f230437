package com.gs.ep.cadtranslate.translate;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消标志。在文档之间和区域之间检查，正在进行的单个实体替换不会被打断。
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
