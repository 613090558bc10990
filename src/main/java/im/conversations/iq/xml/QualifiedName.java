package im.conversations.iq.xml;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/** Namespace URI and local name of an element. Prefixes never take part in equality. */
public final class QualifiedName {

    public final String namespace;
    public final String name;

    public QualifiedName(final String namespace, final String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "local name must not be empty");
        this.namespace = Strings.nullToEmpty(namespace);
        this.name = name;
    }

    public static QualifiedName of(final String namespace, final String name) {
        return new QualifiedName(namespace, name);
    }

    public boolean hasNamespace() {
        return !this.namespace.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QualifiedName that = (QualifiedName) o;
        return Objects.equal(namespace, that.namespace) && Objects.equal(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(namespace, name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("namespace", namespace)
                .add("name", name)
                .toString();
    }
}
