package site.tidepool.datastructure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 集合数据结构实现
 *
 * <p>成员按插入顺序保存，SMEMBERS 和集合运算的结果顺序因此是确定的。
 *
 * @author tidepool
 * @since 1.0.0
 */
public class RedisSet implements RedisData {

    private final LinkedHashSet<RedisBytes> members;

    public RedisSet() {
        this.members = new LinkedHashSet<>();
    }

    public RedisSet(final Collection<RedisBytes> members) {
        this.members = new LinkedHashSet<>(members);
    }

    @Override
    public String getTypeName() {
        return "set";
    }

    /**
     * 添加成员。
     *
     * @return 新加入的成员数量
     */
    public int add(final List<RedisBytes> values) {
        int count = 0;
        for (final RedisBytes value : values) {
            if (members.add(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 移除成员。
     *
     * @return 实际移除的成员数量
     */
    public int remove(final List<RedisBytes> values) {
        int count = 0;
        for (final RedisBytes value : values) {
            if (members.remove(value)) {
                count++;
            }
        }
        return count;
    }

    public boolean contains(final RedisBytes value) {
        return members.contains(value);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public List<RedisBytes> getMembers() {
        return new ArrayList<>(members);
    }

    /**
     * 只读视图，供集合运算使用。
     */
    public Set<RedisBytes> view() {
        return Collections.unmodifiableSet(members);
    }
}
