package cover.util;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Small helpers for joining.
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < strs.size(); i++){
			if (i != 0){
				builder.append(separator);
			}
			builder.append(strs.get(i));
		}
		return builder.toString();
	}

	public static <T> String toString(String joiner, Collection<T> objs){
		return objs.stream().map(Object::toString).collect(Collectors.joining(joiner));
	}
}
