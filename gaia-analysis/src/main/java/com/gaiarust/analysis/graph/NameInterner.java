package com.gaiarust.analysis.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 名称驻留表：把类型名 / 生命周期名一次性映射为从 0 开始的小整数 id，
 * 后续图算法只处理 id。
 */
public final class NameInterner {

    private final Map<String, Integer> ids = new HashMap<String, Integer>();
    private final List<String> names = new ArrayList<String>();

    /** 返回 name 的 id，首次出现时分配新 id */
    public int intern(String name) {
        Integer id = ids.get(name);
        if (id != null) return id;
        int next = names.size();
        ids.put(name, next);
        names.add(name);
        return next;
    }

    /** 查找已驻留的 id，未驻留返回 -1 */
    public int idOf(String name) {
        Integer id = ids.get(name);
        return id != null ? id : -1;
    }

    public String nameOf(int id) {
        return names.get(id);
    }

    public int size() {
        return names.size();
    }
}
