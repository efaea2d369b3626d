package com.weixiao.kit.obj;

import com.weixiao.kit.errors.UnknownObjectTypeException;
import com.weixiao.kit.errors.UnsupportedObjectTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ObjectType / GitObjects 测试")
class ObjectTypeTest {

    @Test
    @DisplayName("按小写类型名查找")
    void fromName_knownTypes() throws Exception {
        assertThat(ObjectType.fromName("blob")).isEqualTo(ObjectType.BLOB);
        assertThat(ObjectType.fromName("tree")).isEqualTo(ObjectType.TREE);
        assertThat(ObjectType.fromName("commit")).isEqualTo(ObjectType.COMMIT);
        assertThat(ObjectType.fromName("tag")).isEqualTo(ObjectType.TAG);
    }

    /**
     * 类型名区分大小写，"Blob"、"bogus" 都不认识。
     */
    @Test
    @DisplayName("未知类型名抛出 UnknownObjectTypeException")
    void fromName_unknown() {
        assertThatThrownBy(() -> ObjectType.fromName("bogus"))
                .isInstanceOf(UnknownObjectTypeException.class)
                .hasMessageContaining("bogus");
        assertThatThrownBy(() -> ObjectType.fromName("Blob"))
                .isInstanceOf(UnknownObjectTypeException.class);
    }

    @Test
    @DisplayName("按类型分派到对应解析器")
    void parse_dispatchesByType() throws Exception {
        assertThat(GitObjects.parse(ObjectType.BLOB, new byte[]{'x'})).isInstanceOf(Blob.class);
        assertThat(GitObjects.parse(ObjectType.TREE, new byte[0])).isInstanceOf(Tree.class);
        assertThat(GitObjects.parse(ObjectType.COMMIT, "tree x\n\nmsg".getBytes())).isInstanceOf(Commit.class);
    }

    @Test
    @DisplayName("tag 对象无法构造")
    void parse_tagUnsupported() {
        assertThatThrownBy(() -> GitObjects.parse(ObjectType.TAG, new byte[0]))
                .isInstanceOf(UnsupportedObjectTypeException.class)
                .hasMessageContaining("tag");
    }
}
