package cn.bafuka.tiercache.transport.impl;

import cn.bafuka.tiercache.transport.RemoteReply;
import cn.bafuka.tiercache.transport.RemoteTransport;

/**
 * 未配置远程缓存时使用的传输实现
 * 所有命令都返回 DISABLED，缓存退化为仅 L1 模式
 */
public final class DisabledRemoteTransport implements RemoteTransport {

    public static final DisabledRemoteTransport INSTANCE = new DisabledRemoteTransport();

    private DisabledRemoteTransport() {
    }

    @Override
    public RemoteReply execute(String... command) {
        return RemoteReply.disabled();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String getType() {
        return "disabled";
    }
}
