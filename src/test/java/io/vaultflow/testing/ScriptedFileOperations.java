package io.vaultflow.testing;

import io.vaultflow.engine.FileOperations;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegates to the real filesystem but can fail the n-th call of an operation, or run a
 * hook right before a read, rename or publish, to simulate crashes and competing processes.
 */
public final class ScriptedFileOperations implements FileOperations {
    public enum Op {
        CREATE,
        READ,
        RENAME,
        PUBLISH,
        DELETE
    }

    @FunctionalInterface
    public interface RenameHook {
        void beforeRename(Path source, Path target) throws IOException;
    }

    @FunctionalInterface
    public interface ReadHook {
        void beforeRead(Path path) throws IOException;
    }

    private final FileOperations delegate;
    private final Map<Op, AtomicInteger> calls = new EnumMap<>(Op.class);
    private final Map<Op, Integer> failOn = new EnumMap<>(Op.class);
    private volatile RenameHook renameHook;
    private volatile ReadHook readHook;
    private volatile RenameHook publishHook;

    public ScriptedFileOperations(FileOperations delegate) {
        this.delegate = delegate;
        for (Op op : Op.values()) {
            calls.put(op, new AtomicInteger());
        }
    }

    public static ScriptedFileOperations overNio() {
        return new ScriptedFileOperations(FileOperations.nio());
    }

    /**
     * Fails the {@code nth} (1-based) call of {@code op} with an {@link IOException}.
     */
    public ScriptedFileOperations failOn(Op op, int nth) {
        failOn.put(op, nth);
        return this;
    }

    public ScriptedFileOperations onRename(RenameHook hook) {
        this.renameHook = hook;
        return this;
    }

    public ScriptedFileOperations onPublish(RenameHook hook) {
        this.publishHook = hook;
        return this;
    }

    public ScriptedFileOperations onRead(ReadHook hook) {
        this.readHook = hook;
        return this;
    }

    public int calls(Op op) {
        return calls.get(op).get();
    }

    @Override
    public void create(Path path, String content) throws IOException {
        tick(Op.CREATE, path);
        delegate.create(path, content);
    }

    @Override
    public String read(Path path) throws IOException {
        tick(Op.READ, path);
        ReadHook hook = readHook;
        if (hook != null) {
            hook.beforeRead(path);
        }
        return delegate.read(path);
    }

    @Override
    public void rename(Path source, Path target) throws IOException {
        tick(Op.RENAME, source);
        RenameHook hook = renameHook;
        if (hook != null) {
            hook.beforeRename(source, target);
        }
        delegate.rename(source, target);
    }

    @Override
    public void publish(Path source, Path target) throws IOException {
        tick(Op.PUBLISH, source);
        RenameHook hook = publishHook;
        if (hook != null) {
            hook.beforeRename(source, target);
        }
        delegate.publish(source, target);
    }

    @Override
    public void delete(Path path) throws IOException {
        tick(Op.DELETE, path);
        delegate.delete(path);
    }

    private void tick(Op op, Path path) throws IOException {
        int n = calls.get(op).incrementAndGet();
        Integer target = failOn.get(op);
        if (target != null && target == n) {
            throw new IOException("injected " + op + " failure #" + n + " on " + path);
        }
    }
}
