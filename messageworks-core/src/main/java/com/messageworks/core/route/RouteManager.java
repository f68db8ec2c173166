package com.messageworks.core.route;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.messageworks.core.message.Address;
import com.messageworks.core.message.Message;
import com.messageworks.core.util.AddressUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 路由管理器，负责单个上下文内的路由决策：消息由本地处理、转发到上游，还是分发给哪些子上下文。
 * 只做决策，不执行分发。
 */
@Slf4j
public class RouteManager {

    @Getter
    private final Address here;
    private final Map<String, ChildRoute> children;

    public RouteManager(Address here, Map<String, ChildRoute> children) {
        this.here = here;
        this.children = children;
    }

    /**
     * 消息是否应在本上下文处理（广播或目标地址为本上下文）。
     */
    public boolean isAddressedHere(Message message) {
        return message.isBroadcast() || AddressUtils.equal(message.getDestination(), here);
    }

    public boolean isUpstream(Address destination) {
        return AddressUtils.isUpstream(here, destination);
    }

    /**
     * 发送时的下游分发目标：广播则为全部子上下文，否则为与目标地址完全匹配或为其下一跳的子上下文。
     */
    public List<ChildRoute> resolveDownstream(Message message) {
        if (message.isBroadcast()) {
            return new ArrayList<>(children.values());
        }
        return resolveForward(message.getDestination());
    }

    /**
     * 转发时的下游目标：与目标地址完全匹配或为其下一跳的子上下文。
     */
    public List<ChildRoute> resolveForward(Address destination) {
        List<ChildRoute> targets = new ArrayList<>();
        if (destination == null) {
            return targets;
        }
        Optional<Address> nextHop = AddressUtils.nextHop(here, destination);
        for (ChildRoute child : children.values()) {
            if (AddressUtils.equal(child.getAddress(), destination)
                    || nextHop.map(hop -> AddressUtils.equal(child.getAddress(), hop)).orElse(false)) {
                targets.add(child);
            }
        }
        if (targets.isEmpty()) {
            log.debug("RouteManager[{}]: 没有子上下文匹配目标地址 {}", here, destination);
        }
        return targets;
    }
}
