package com.yerin.storyq.infra;

import java.net.InetAddress;
import java.util.UUID;

public final class WorkerId {
    private WorkerId() {}

    /**
     * 호스트 단위 접두사. 워커 스레드는 여기에 "-{index}" 를 붙여 쓴다.
     */
    public static String hostPrefix() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (Exception e) {
            return "worker-" + suffix;
        }
    }

    public static String of(String hostPrefix, int index) {
        return hostPrefix + "-" + index;
    }
}
