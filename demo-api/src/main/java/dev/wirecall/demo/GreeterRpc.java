package dev.wirecall.demo;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcResult;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.server.ServiceDefinition;

/**
 * Wire description of {@link Greeter}: method identifiers, parameter names and result types shared
 * by the client stubs and the server dispatch table.
 */
public final class GreeterRpc {

    public static final ServiceDefinition<Greeter> DEFINITION = ServiceDefinition.<Greeter>builder("Greeter")
        .method("describe", (greeter, params) ->
            greeter.describe(params.read("subject", String.class), params.read("value", Integer.class)))
        .method("fail", (greeter, params) -> greeter.fail(params.read("reason", String.class)))
        .method("add", (greeter, params) -> greeter.add(params.read("a", Long.class), params.read("b", Long.class)))
        .build();

    public static final MethodId DESCRIBE = DEFINITION.method("describe");

    public static final MethodId FAIL = DEFINITION.method("fail");

    public static final MethodId ADD = DEFINITION.method("add");

    static final RpcType<RpcResult<String, GreeterError>> TEXT_RESULT =
        RpcType.of(new TypeReference<RpcResult<String, GreeterError>>() {
        });

    static final RpcType<RpcResult<Long, GreeterError>> NUMBER_RESULT =
        RpcType.of(new TypeReference<RpcResult<Long, GreeterError>>() {
        });

    private GreeterRpc() {
    }
}
