package com.williamcallahan.keycoordinator.service.retry;

import com.williamcallahan.keycoordinator.service.credential.Credential;

/**
 * One external call bound to a credential. Implementations make exactly one provider request per
 * invocation and never retry internally.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface UnitOfWork<R> {

    R execute(Credential credential) throws Exception;
}
