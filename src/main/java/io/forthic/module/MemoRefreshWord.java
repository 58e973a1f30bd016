package io.forthic.module;

import io.forthic.model.RuntimeValue;
import io.forthic.runtime.Interpreter;

public final class MemoRefreshWord extends Word {
    private final MemoWord memo;
    private final boolean pushValue;

    public MemoRefreshWord(MemoWord memo, boolean pushValue) {
        super(memo.name() + (pushValue ? "!@" : "!"));
        this.memo = memo;
        this.pushValue = pushValue;
    }

    @Override
    protected void run(Interpreter interp) {
        RuntimeValue value = memo.refresh(interp);
        if (pushValue) {
            interp.push(value);
        }
    }
}
