package it.unimib.datai.lambdagateway.gateway.hook;

import reactor.core.publisher.Mono;

final class RequestEnvelopePayloadBuilder implements PayloadBuilder {
    static final RequestEnvelopePayloadBuilder INSTANCE = new RequestEnvelopePayloadBuilder();

    private RequestEnvelopePayloadBuilder() {
    }

    @Override
    public Mono<Object> build(RequestContext context) {
        return Mono.just(context.toEnvelope());
    }
}
