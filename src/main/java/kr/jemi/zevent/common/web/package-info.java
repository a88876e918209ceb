@NamedInterface("web")
package kr.jemi.zevent.common.web;

import org.springframework.modulith.NamedInterface;
