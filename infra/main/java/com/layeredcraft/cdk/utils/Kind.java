package com.layeredcraft.cdk.utils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class Kind {

    private static final Logger logger = LogManager.getLogger(Kind.class);

    private Kind() {}

    public static void debugf(String fmt, Object... args) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format(fmt, args));
        }
    }

    public static void infof(String fmt, Object... args) {
        if (logger.isInfoEnabled()) {
            logger.info(String.format(fmt, args));
        }
    }

    public static void warnf(String fmt, Object... args) {
        logger.warn(String.format(fmt, args));
    }
}
