package com.messageworks.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.messageworks.core.message.Address;

/**
 * 地址工具类。
 * 负责层级地址的规范化、字符串与分段形式之间的转换、相等性判断以及上下游关系判断。
 * <p>
 * 地址的字符串形式使用 {@code /} 作为分隔符，规范形式为 {@code /a/b/c}，根地址为 {@code /}。
 */
public final class AddressUtils {

    public static final String SEPARATOR = "/";
    public static final String ROOT = SEPARATOR;

    private AddressUtils() {
        // 私有构造函数，防止实例化
    }

    /**
     * 规范化字符串地址：去除每段首尾空白，丢弃空段，折叠重复的分隔符。
     * 结果不含首尾分隔符，例如 {@code "  /earth///continent/ "} 规范化为 {@code "earth/continent"}。
     *
     * @param address 字符串地址，空字符串表示根
     * @return 规范化后的字符串
     * @throws IllegalArgumentException address 为 null
     */
    public static String normalize(String address) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        return String.join(SEPARATOR, split(address));
    }

    /**
     * 规范化分段地址。包含分隔符的段会被继续拆分。
     *
     * @param segments 分段地址，空列表表示根
     * @return 规范化后的分段列表（可修改的新列表）
     * @throws IllegalArgumentException segments 为 null
     */
    public static List<String> normalize(List<String> segments) {
        if (segments == null) {
            throw new IllegalArgumentException("address segments must not be null");
        }
        List<String> result = new ArrayList<>(segments.size());
        for (String segment : segments) {
            if (segment != null) {
                result.addAll(split(segment));
            }
        }
        return result;
    }

    public static List<String> toSegments(String address) {
        return Collections.unmodifiableList(split(requireNonNull(address)));
    }

    public static List<String> toSegments(List<String> segments) {
        return Collections.unmodifiableList(normalize(segments));
    }

    public static List<String> toSegments(Address address) {
        return requireNonNull(address).getSegments();
    }

    public static String toString(String address) {
        return join(toSegments(address));
    }

    public static String toString(List<String> segments) {
        return join(toSegments(segments));
    }

    public static String toString(Address address) {
        return join(toSegments(address));
    }

    /**
     * 判断两个地址是否相等（规范分段逐一相同）。任一为 null 时返回 false。
     */
    public static boolean equal(Address a, Address b) {
        if (a == null || b == null) {
            return false;
        }
        return a.getSegments().equals(b.getSegments());
    }

    public static boolean equal(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return split(a).equals(split(b));
    }

    public static boolean equal(List<String> a, List<String> b) {
        if (a == null || b == null) {
            return false;
        }
        return normalize(a).equals(normalize(b));
    }

    /**
     * 判断 {@code there} 相对 {@code here} 是否位于上游方向。
     * <ul>
     * <li>here 为根：任何地址都不是上游，返回 false</li>
     * <li>there 层级更浅：严格祖先，返回 true</li>
     * <li>前 |here| 段存在不一致：分叉的兄弟分支，同样经上游链路转发至公共祖先，返回 true</li>
     * <li>其余情况（自身或后代）：返回 false</li>
     * </ul>
     */
    public static boolean isUpstream(Address here, Address there) {
        if (here == null || there == null) {
            return false;
        }
        List<String> from = here.getSegments();
        List<String> to = there.getSegments();
        int fromLevel = from.size();
        int toLevel = to.size();

        if (fromLevel == 0) {
            return false;
        }
        if (toLevel < fromLevel) {
            return true;
        }
        for (int i = 0; i < fromLevel; i++) {
            if (!from.get(i).equals(to.get(i))) {
                return true;
            }
        }
        return false;
    }

    public static boolean isUpstream(String here, String there) {
        if (here == null || there == null) {
            return false;
        }
        return isUpstream(Address.parse(here), Address.parse(there));
    }

    /**
     * 计算从 {@code here} 到 {@code destination} 的下一跳：位于 here 下一层、且是 destination 的祖先（或其本身）的子地址。
     *
     * @return 下一跳地址；destination 不严格位于 here 之下时返回空
     */
    public static Optional<Address> nextHop(Address here, Address destination) {
        if (here == null || destination == null) {
            return Optional.empty();
        }
        List<String> from = here.getSegments();
        List<String> to = destination.getSegments();
        if (to.size() <= from.size() || !to.subList(0, from.size()).equals(from)) {
            return Optional.empty();
        }
        return Optional.of(Address.of(to.subList(0, from.size() + 1)));
    }

    static List<String> split(String address) {
        List<String> result = new ArrayList<>();
        for (String part : address.split(SEPARATOR)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static String join(List<String> segments) {
        return ROOT + String.join(SEPARATOR, segments);
    }

    private static <T> T requireNonNull(T address) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        return address;
    }
}
