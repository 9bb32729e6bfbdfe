package com.booking.sync.core.interceptor;

import com.booking.sync.core.args.ProgressArgs;

@FunctionalInterface
public interface InterceptorHandler<T extends ProgressArgs> {

    void handle(T args) throws Exception;
}
