package uk.gegc.surveylink.features.onelink.application;

/**
 * Business action run while a link is being consumed. It is invoked at most once per token,
 * after the link was confirmed unused and before it is marked used. Throwing aborts the
 * consumption and leaves the link unused.
 */
@FunctionalInterface
public interface LinkAction<T> {

    T execute(ConsumedLink link);
}
