package tickwork.engine.worker;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Names this process in results, locks and logs: {@code host:pid:suffix}.
 */
public final class WorkerIdentity {

    private WorkerIdentity() {
    }

    public static String generate(String role) {
        return role + "@" + hostName() + ":" + ProcessHandle.current().pid() + ":"
                + UUID.randomUUID().toString().substring(0, 6);
    }

    static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String runtime = ManagementFactory.getRuntimeMXBean().getName();
            int at = runtime.indexOf('@');
            return at >= 0 ? runtime.substring(at + 1) : "unknown-host";
        }
    }
}
