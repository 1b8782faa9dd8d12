package dev.wirecall.rpc.server;

import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.ServerTransport;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves calls arriving on one transport, strictly one after another.
 *
 * @param <I> service implementation type
 * @param <RX> transport reception state
 */
public final class RpcServer<I, RX> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcServer.class);

    private final ServiceDefinition<I> definition;
    private final I service;
    private final ServerTransport<RX> transport;

    public RpcServer(ServiceDefinition<I> definition, I service, ServerTransport<RX> transport) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.service = Objects.requireNonNull(service, "service");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public static <I, RX> RpcServer<I, RX> create(ServiceDefinition<I> definition, I service,
                                                  ServerTransport<RX> transport) {
        return new RpcServer<>(definition, service, transport);
    }

    public ServerTransport<RX> transport() {
        return transport;
    }

    /**
     * Receive, dispatch and answer one call. An unknown method is raised here and nothing is
     * written to the peer.
     */
    public void serveSingleCall() throws RpcException {
        ServerTransport.Received<RX> received = transport.beginReceive();
        ServiceDefinition.Entry<I> entry = definition.resolve(received.method())
            .orElseThrow(() -> RpcException.unknownMethod(received.method()));
        LOGGER.debug("Dispatching {}.{}", definition.serviceName(), entry.id());
        RX state = received.state();
        Object response = entry.handler().invoke(service, new CallParams() {
            @Override
            public <T> T read(String name, RpcType<T> type) throws RpcException {
                return transport.readParam(name, type, state);
            }
        });
        transport.sendResponse(response);
    }

    /**
     * Serve calls until {@code done} reports true. The condition is checked after each call only,
     * so at least one call is served.
     */
    public void serveUntil(BooleanSupplier done) throws RpcException {
        do {
            serveSingleCall();
        } while (!done.getAsBoolean());
    }

    /**
     * Serve calls until the transport fails, normally with {@code TRANSPORT_EOF} once the peer
     * disconnects.
     */
    public void serve() throws RpcException {
        while (true) {
            serveSingleCall();
        }
    }
}
