package im.arun.docingest.scheduler;

@FunctionalInterface
public interface WorkFunction<T, R> {

    R apply(T unit) throws Exception;
}
