package it.unimib.datai.lambdagateway.gateway.hook;

import reactor.core.publisher.Mono;

/**
 * Pre-invocation hook. The emitted value replaces the default payload wholesale;
 * an error signal (or a thrown exception) aborts the request before the remote call.
 */
@FunctionalInterface
public interface PayloadBuilder {

    Mono<Object> build(RequestContext context);

    /**
     * Default payload: the request split by origin.
     */
    static PayloadBuilder requestEnvelope() {
        return RequestEnvelopePayloadBuilder.INSTANCE;
    }
}
